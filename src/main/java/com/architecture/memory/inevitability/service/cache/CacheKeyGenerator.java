package com.architecture.memory.inevitability.service.cache;

import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.model.intervention.InterventionSet;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Generates collision-resistant keys from canonical query serializations.
 */
public final class CacheKeyGenerator {

    private static final String KEY_VERSION = "v1";

    private CacheKeyGenerator() {
        // Utility class
    }

    public static String forSolve(GoalPredicate goal, InterventionSet interventions, boolean trackUnsatCore) {
        String canonical = "goal=" + goal.getId() + "|expr=" + goal.getExpression().describe()
                + "|do=" + interventions.canonical() + "|core=" + trackUnsatCore;
        return buildKey("solve", canonical);
    }

    public static String forInterventions(InterventionSet interventions) {
        return buildKey("do", interventions.canonical());
    }

    public static String forQuery(String prefix, String canonicalPayload) {
        return buildKey(prefix, canonicalPayload);
    }

    private static String buildKey(String prefix, String canonicalPayload) {
        String payload = KEY_VERSION + "|" + prefix + "|" + canonicalPayload;
        return prefix + ":" + KEY_VERSION + ":" + sha256Hex(payload);
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(Character.forDigit((b >> 4) & 0xf, 16));
                hex.append(Character.forDigit(b & 0xf, 16));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 digest unavailable", e);
        }
    }
}
