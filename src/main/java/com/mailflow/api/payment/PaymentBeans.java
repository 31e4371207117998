package com.mailflow.api.payment;

import com.mailflow.api.payment.providers.PaymentProviderAdapter;
import com.mailflow.api.payment.providers.SquareProviderAdapter;
import com.mailflow.api.payment.providers.StripeProviderAdapter;
import com.mailflow.api.payment.upstream.SquareApi;
import com.mailflow.api.payment.upstream.StripeApi;
import lombok.NonNull;
import lombok.val;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static java.util.Objects.requireNonNull;

/**
 * Spring Beans used by the payment package.
 */
@Configuration
class PaymentBeans {

    static final String CHARGE_EXECUTOR = "paymentChargeExecutor";

    static final String DEFAULT_SQUARE_BASE_URL = "https://connect.squareup.com";

    @NonNull
    @Bean
    ProviderRegistry providerRegistry(
        @NonNull PaymentConfiguration config,
        @NonNull RestTemplateBuilder restTemplateBuilder
    ) {
        val restTemplate = restTemplateBuilder
            .setConnectTimeout(config.getChargeTimeout())
            .setReadTimeout(config.getChargeTimeout())
            .build();

        return new ProviderRegistry(
            config.getProviders()
                .stream()
                .map(p -> ProviderRegistration.builder()
                    .type(p.getType())
                    .priority(p.getPriority())
                    .active(p.isActive())
                    .adapter(createAdapter(p, restTemplate))
                    .build())
                .toList());
    }

    /**
     * Runs charge calls so that callers can stop waiting on a provider after the charge timeout.
     */
    @NonNull
    @Bean(name = CHARGE_EXECUTOR, destroyMethod = "shutdownNow")
    ExecutorService chargeExecutor() {
        val threadFactory = new CustomizableThreadFactory("payment-charge-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    @NonNull
    private static PaymentProviderAdapter createAdapter(
        @NonNull PaymentConfiguration.Provider provider,
        @NonNull RestTemplate restTemplate
    ) {
        switch (provider.getType()) {
            case STRIPE:
                return new StripeProviderAdapter(new StripeApi(provider.getApiKey()), provider.getWebhookSecret());
            case SQUARE:
                val baseUrl = provider.getBaseUrl() == null ? DEFAULT_SQUARE_BASE_URL : provider.getBaseUrl();
                return new SquareProviderAdapter(
                    new SquareApi(restTemplate, baseUrl, provider.getApiKey(), provider.getLocationId()),
                    provider.getWebhookSecret(),
                    requireNonNull(provider.getWebhookNotificationUrl(), "square requires a webhook notification url"));
            default:
                throw new IllegalArgumentException("unsupported payment provider: " + provider.getType());
        }
    }
}
