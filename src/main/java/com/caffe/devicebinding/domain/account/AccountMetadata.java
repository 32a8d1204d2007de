package com.caffe.devicebinding.domain.account;

/**
 * Non-sensitive identifiers shown next to a device mismatch alert.
 */
public record AccountMetadata(String username, String maskedEmail, String observerId, boolean resetPending) {

    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        int at = email.indexOf('@');
        if (at <= 0) {
            return "***";
        }
        String local = email.substring(0, at);
        String domain = email.substring(at);
        return local.charAt(0) + "***" + domain;
    }
}
