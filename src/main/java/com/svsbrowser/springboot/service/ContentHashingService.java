package com.svsbrowser.springboot.service;

import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

@Service
public class ContentHashingService {

    /**
     * SHA-256 of the UTF-8 bytes of {@code content}, as lowercase hex. Used as the chunk fingerprint.
     */
    public String hash(String content) {
        if (content == null) {
            return null;
        }
        return bytesToHex(newDigest().digest(content.getBytes(StandardCharsets.UTF_8)));
    }

    // MessageDigest is not thread-safe, so each call gets its own instance.
    private MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private String bytesToHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(2 * hash.length);
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
