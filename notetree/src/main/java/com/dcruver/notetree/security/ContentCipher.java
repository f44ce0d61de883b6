package com.dcruver.notetree.security;

/**
 * Reversible transformation of note content under a key.
 */
public interface ContentCipher {

    String encrypt(String plainText, String key);

    /**
     * @throws IllegalArgumentException if the text was not produced by {@link #encrypt}
     */
    String decrypt(String cipherText, String key);
}
