package com.dcruver.notetree.security;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * XORs the UTF-8 bytes of the content with the key and Base64-encodes the result,
 * so the cipher text stays printable inside a note file.
 * Obfuscation only, not a security boundary.
 */
public class XorContentCipher implements ContentCipher {

    @Override
    public String encrypt(String plainText, String key) {
        byte[] bytes = xor(plainText.getBytes(StandardCharsets.UTF_8), key);
        return Base64.getEncoder().encodeToString(bytes);
    }

    @Override
    public String decrypt(String cipherText, String key) {
        byte[] bytes = Base64.getDecoder().decode(cipherText.trim());
        return new String(xor(bytes, key), StandardCharsets.UTF_8);
    }

    private static byte[] xor(byte[] data, String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key must not be empty");
        }
        byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
        byte[] out = new byte[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = (byte) (data[i] ^ keyBytes[i % keyBytes.length]);
        }
        return out;
    }
}
