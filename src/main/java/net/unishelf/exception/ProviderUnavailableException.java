package net.unishelf.exception;

/**
 * An external provider could not be queried or its payload could not be read.
 * RECOVERED: always converted to an empty candidate list inside the adapter.
 */
public class ProviderUnavailableException extends RuntimeException {

    private final String provider;

    public ProviderUnavailableException(String provider, String message, Throwable cause) {
        super("Provider " + provider + " unavailable: " + message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
