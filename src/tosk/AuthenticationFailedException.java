package tosk;

import java.security.GeneralSecurityException;

/**
 * The envelope's authentication tag did not verify: wrong passphrase, or the
 * ciphertext was corrupted or tampered with.
 */
public class AuthenticationFailedException extends GeneralSecurityException {

    public AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
