package tosk;

import java.security.GeneralSecurityException;

/**
 * The bytes handed to {@link EncryptionUtils#open(byte[], char[])} cannot be an envelope
 * (shorter than the salt + nonce header, or an undecodable transport encoding).
 */
public class EnvelopeFormatException extends GeneralSecurityException {

    public EnvelopeFormatException(String message) {
        super(message);
    }

    public EnvelopeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
