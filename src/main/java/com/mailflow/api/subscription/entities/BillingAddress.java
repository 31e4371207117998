package com.mailflow.api.subscription.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Postal address that invoices of a {@link Subscription} are issued to.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillingAddress {

    @Column(name = "billing_line1")
    private String line1;

    @Column(name = "billing_line2")
    private String line2;

    @Column(name = "billing_city")
    private String city;

    @Column(name = "billing_state")
    private String state;

    @Column(name = "billing_postal_code")
    private String postalCode;

    @Column(name = "billing_country", length = 2)
    private String country;
}
