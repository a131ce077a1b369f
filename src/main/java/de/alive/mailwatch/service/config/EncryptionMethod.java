package de.alive.mailwatch.service.config;

import java.util.Locale;

public enum EncryptionMethod {
    SSL,
    TLS,
    STARTTLS,
    NONE;

    public static EncryptionMethod parse(String value) {
        return EncryptionMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * @return true if the socket is wrapped in TLS before the greeting
     */
    public boolean isImplicitTls() {
        return this == SSL || this == TLS;
    }
}
