package net.unishelf.service.provider;

import java.util.Locale;

public enum ProviderCallOutcome {
    SUCCESS,
    FAILURE,
    TIMEOUT,
    DISABLED;

    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
