package com.mailflow.api.payment.upstream;


import com.stripe.Stripe;
import com.stripe.StripeClient;
import com.stripe.exception.StripeException;
import com.stripe.model.Customer;
import com.stripe.model.PaymentIntent;
import com.stripe.model.Refund;
import com.stripe.model.Subscription;
import com.stripe.net.RequestOptions;
import com.stripe.param.CustomerCreateParams;
import com.stripe.param.PaymentIntentCreateParams;
import com.stripe.param.RefundCreateParams;
import com.stripe.param.SubscriptionCreateParams;
import lombok.NonNull;
import lombok.val;

import java.util.Map;

import static java.util.Objects.requireNonNullElse;

/**
 * A thin wrapper around {@link Stripe} api to enable easy mocking.
 */
public class StripeApi {

    private final StripeClient client;

    public StripeApi(@NonNull String apiKey) {
        client = new StripeClient(apiKey);
    }

    /**
     * Creates and confirms an off-session card payment for a customer.
     *
     * @param amount          amount in the smallest currency unit.
     * @param currency        three-letter ISO currency code.
     * @param customerId      Stripe customer id of the payer.
     * @param paymentMethodId Stripe payment method id, or {@literal null} to let Stripe use the
     *                        customer's default payment method.
     * @param description     an optional description shown on the Stripe dashboard.
     * @param metadata        optional metadata attached to the payment intent.
     * @param idempotencyKey  a key that makes retries of this request safe.
     * @return the created payment intent.
     * @throws StripeException on api call error, including card declines.
     */
    @NonNull
    public PaymentIntent createPaymentIntent(
        long amount,
        @NonNull String currency,
        @NonNull String customerId,
        String paymentMethodId,
        String description,
        Map<String, String> metadata,
        @NonNull String idempotencyKey
    ) throws StripeException {
        return client.paymentIntents().create(
            PaymentIntentCreateParams.builder()
                .setAmount(amount)
                .setCurrency(currency.toLowerCase())
                .setCustomer(customerId)
                .setPaymentMethod(paymentMethodId)
                .addPaymentMethodType("card")
                .setConfirm(true)
                .setOffSession(true)
                .setDescription(description)
                .putAllMetadata(requireNonNullElse(metadata, Map.of()))
                .build(),
            idempotent(idempotencyKey));
    }

    /**
     * @param paymentIntentId id of the payment intent to refund.
     * @param amount          amount to refund in the smallest currency unit, or {@literal null} to
     *                        refund the full amount.
     * @see com.stripe.service.RefundService#create(RefundCreateParams, RequestOptions)
     */
    @NonNull
    public Refund createRefund(@NonNull String paymentIntentId, Long amount) throws StripeException {
        return client.refunds().create(
            RefundCreateParams.builder()
                .setPaymentIntent(paymentIntentId)
                .setAmount(amount)
                .build());
    }

    /**
     * @see com.stripe.service.CustomerService#create(CustomerCreateParams, RequestOptions)
     */
    @NonNull
    public Customer createCustomer(String email, String name, Map<String, String> metadata) throws StripeException {
        return client.customers().create(
            CustomerCreateParams.builder()
                .setEmail(email)
                .setName(name)
                .putAllMetadata(requireNonNullElse(metadata, Map.of()))
                .build());
    }

    /**
     * Creates a single-item subscription on a recurring Stripe price.
     *
     * @param trialPeriodDays the number of trial days, or {@literal null} for no trial.
     * @see com.stripe.service.SubscriptionService#create(SubscriptionCreateParams, RequestOptions)
     */
    @NonNull
    public Subscription createSubscription(
        @NonNull String customerId,
        @NonNull String priceId,
        Long trialPeriodDays,
        Map<String, String> metadata,
        @NonNull String idempotencyKey
    ) throws StripeException {
        return client.subscriptions().create(
            SubscriptionCreateParams.builder()
                .setCustomer(customerId)
                .addItem(
                    SubscriptionCreateParams.Item.builder()
                        .setPrice(priceId)
                        .build())
                .setTrialPeriodDays(trialPeriodDays)
                .putAllMetadata(requireNonNullElse(metadata, Map.of()))
                .build(),
            idempotent(idempotencyKey));
    }

    /**
     * Immediately cancels a subscription unless it is already cancelled.
     *
     * @param id id of the subscription to cancel.
     * @throws StripeException on Stripe API errors.
     */
    public void cancelSubscription(@NonNull String id) throws StripeException {
        val subscription = client.subscriptions().retrieve(id);
        if ("canceled".equals(subscription.getStatus())) {
            return;
        }

        client.subscriptions().cancel(id);
    }

    @NonNull
    private static RequestOptions idempotent(@NonNull String idempotencyKey) {
        return RequestOptions.builder()
            .setIdempotencyKey(idempotencyKey)
            .build();
    }
}
