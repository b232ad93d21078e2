package com.powerlevel.tracker.model;

import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One tracked GitHub repository. The hash partitions the local cache.
 */
@Value
public class RepositoryContext {
    String owner;
    String name;
    String hash;

    public static RepositoryContext of(String owner, String name) {
        return new RepositoryContext(owner, name, hashOf(owner, name));
    }

    public String getSlug() {
        return owner + "/" + name;
    }

    static String hashOf(String owner, String name) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest((owner + "/" + name).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
