package com.mailflow.api.subscription.entities;

import com.mailflow.api.payment.models.PaymentProviderType;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import lombok.val;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A data access object that maps to the {@code invoice} table in the database.
 *
 * <p>
 * {@link #getAmountDue() amountDue} is derived from {@link #getTotal() total} and {@link
 * #getAmountPaid() amountPaid}, and is never set directly. A cycle invoice is unique per
 * subscription and period, so generating it twice yields the same invoice.</p>
 */
@Entity
@Table(
    uniqueConstraints = {
        @UniqueConstraint(
            name = "invoice_subscription_kind_period_key",
            columnNames = {"subscription_id", "kind", "periodStart", "periodEnd"}),
        @UniqueConstraint(name = "invoice_tenant_sequence_key", columnNames = {"tenantId", "sequenceNumber"}),
        @UniqueConstraint(name = "invoice_number_key", columnNames = "invoiceNumber"),
    },
    indexes = {
        @Index(name = "invoice_tenant_id_idx", columnList = "tenantId"),
        @Index(name = "invoice_next_payment_attempt_at_idx", columnList = "nextPaymentAttemptAt"),
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Invoice {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Version
    private long version;

    @NonNull
    @Column(updatable = false)
    private String tenantId;

    @NonNull
    @ManyToOne(optional = false, fetch = FetchType.EAGER)
    @JoinColumn(name = "subscription_id", updatable = false)
    private Subscription subscription;

    @NonNull
    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private Kind kind;

    @Column(updatable = false)
    private long sequenceNumber;

    @NonNull
    @Column(updatable = false)
    private String invoiceNumber;

    @NonNull
    @Enumerated(EnumType.STRING)
    private Status status;

    @NonNull
    @Column(length = 3)
    private String currency;

    @NonNull
    @Column(precision = 19, scale = 4)
    private BigDecimal subtotal;

    @NonNull
    @Column(precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal taxAmount = BigDecimal.ZERO;

    @NonNull
    @Column(precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal discountAmount = BigDecimal.ZERO;

    @NonNull
    @Column(precision = 19, scale = 4)
    private BigDecimal total;

    @NonNull
    @Column(precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal amountPaid = BigDecimal.ZERO;

    @Column(precision = 19, scale = 4)
    @Setter(AccessLevel.NONE)
    private BigDecimal amountDue;

    @NonNull
    private OffsetDateTime dueDate;

    private OffsetDateTime paidAt;

    @NonNull
    @Column(updatable = false)
    private OffsetDateTime periodStart;

    @NonNull
    @Column(updatable = false)
    private OffsetDateTime periodEnd;

    @NonNull
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "invoice_line_item", joinColumns = @JoinColumn(name = "invoice_id"))
    @OrderColumn(name = "line_position")
    @Builder.Default
    private List<InvoiceLineItem> lineItems = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    private PaymentProviderType paymentProvider;

    private String providerReference;

    private int paymentAttempts;

    /**
     * When the next automatic payment attempt is due. {@literal null} once no further attempt is
     * scheduled.
     */
    private OffsetDateTime nextPaymentAttemptAt;

    private String lastPaymentError;

    public void setTotal(@NonNull BigDecimal total) {
        this.total = total;
        recomputeAmountDue();
    }

    public void setAmountPaid(@NonNull BigDecimal amountPaid) {
        this.amountPaid = amountPaid;
        recomputeAmountDue();
    }

    /**
     * @return {@code max(0, total - amountPaid)}.
     */
    public BigDecimal getAmountDue() {
        if (total == null) {
            return amountDue;
        }

        val paid = amountPaid == null ? BigDecimal.ZERO : amountPaid;
        return total.subtract(paid).max(BigDecimal.ZERO);
    }

    public boolean isPayable() {
        return status == Status.OPEN && getAmountDue().signum() > 0;
    }

    /**
     * Settles the invoice in full.
     */
    public void markPaid(PaymentProviderType provider, String reference, @NonNull OffsetDateTime paidAt) {
        this.status = Status.PAID;
        this.paymentProvider = provider;
        this.providerReference = reference;
        this.paidAt = paidAt;
        this.nextPaymentAttemptAt = null;
        this.lastPaymentError = null;
        setAmountPaid(total);
    }

    @PrePersist
    @PreUpdate
    void recomputeAmountDue() {
        this.amountDue = getAmountDue();
    }

    public enum Kind {
        /**
         * Regular invoice for a billing period.
         */
        CYCLE,

        /**
         * Out-of-cycle charge for an immediately billed plan upgrade.
         */
        PRORATION,

        /**
         * Out-of-cycle charge for usage beyond plan quotas.
         */
        OVERAGE,
    }

    public enum Status {
        OPEN,
        PAID,
        PAYMENT_FAILED,
        VOID,
    }
}
