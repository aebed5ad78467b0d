package com.example.syncengine.token;

/**
 * Encrypts credential fields before they reach the database.
 */
public interface TokenCipher {

    String encrypt(String plaintext);

    String decrypt(String ciphertext);
}
