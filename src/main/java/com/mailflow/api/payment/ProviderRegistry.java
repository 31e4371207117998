package com.mailflow.api.payment;

import com.mailflow.api.payment.models.PaymentProviderType;
import lombok.NonNull;
import lombok.val;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable set of provider registrations, ordered by ascending priority at construction.
 */
public class ProviderRegistry {

    private final List<ProviderRegistration> ordered;
    private final Map<PaymentProviderType, ProviderRegistration> byType;

    /**
     * @throws IllegalArgumentException if a provider type is registered more than once.
     */
    public ProviderRegistry(@NonNull List<ProviderRegistration> registrations) {
        this.ordered = registrations.stream()
            .sorted(Comparator.comparingInt(ProviderRegistration::getPriority))
            .toList();

        this.byType = new EnumMap<>(PaymentProviderType.class);
        for (val registration : ordered) {
            if (byType.put(registration.getType(), registration) != null) {
                throw new IllegalArgumentException("duplicate registration for payment provider " + registration.getType());
            }
        }
    }

    @NonNull
    public Optional<ProviderRegistration> find(@NonNull PaymentProviderType type) {
        return Optional.ofNullable(byType.get(type));
    }

    /**
     * @return active registrations, highest priority (lowest value) first.
     */
    @NonNull
    public List<ProviderRegistration> active() {
        return ordered.stream()
            .filter(ProviderRegistration::isActive)
            .toList();
    }
}
