package com.mailflow.api.payment.models;

/**
 * Classifies why a payment attempt did not succeed.
 */
public enum PaymentErrorKind {

    /**
     * The provider could not be reached, timed out, rate-limited the request or failed internally.
     * The charge did not happen, and the same request may succeed on another provider.
     */
    PROVIDER_UNAVAILABLE,

    /**
     * The provider declined the payment method.
     */
    CARD_DECLINED,

    /**
     * The fraud screen declined the request before any provider was contacted.
     */
    FRAUD_DECLINED,

    /**
     * The request was malformed or referenced objects that the provider doesn't know about.
     */
    INVALID_REQUEST,

    UNKNOWN;

    /**
     * @return whether a failure of this kind may be retried on a different provider within the
     * same dispatch.
     */
    public boolean isFallbackEligible() {
        return this == PROVIDER_UNAVAILABLE;
    }
}
