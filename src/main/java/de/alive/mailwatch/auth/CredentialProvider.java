package de.alive.mailwatch.auth;

import de.alive.mailwatch.exception.AuthenticationException;
import de.alive.mailwatch.infrastructure.MailCredentials;
import org.jetbrains.annotations.NotNull;

/**
 * Supplies login material for each new connection.
 */
public interface CredentialProvider {

    /**
     * @throws AuthenticationException if no usable credential can be produced
     */
    @NotNull MailCredentials obtain() throws AuthenticationException;

    /**
     * Called when the server rejected the last credential.
     *
     * @return true if another {@link #obtain()} may yield a credential worth retrying with
     */
    boolean invalidate();
}
