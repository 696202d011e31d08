package me.synapsed.alerts.utils;

import java.util.Map;

/**
 * CloudFormation intrinsic function values.
 */
public final class Intrinsics {

    private Intrinsics() {
    }

    public static Map<String, Object> ref(String logicalId) {
        return Map.of("Ref", logicalId);
    }

    public static Map<String, Object> sub(String template) {
        return Map.of("Fn::Sub", template);
    }

    /**
     * Escapes a literal so {@code Fn::Sub} does not treat it as a variable.
     */
    public static String escapeSub(String literal) {
        return literal.replace("${", "${!");
    }
}
