package com.mailattribution.client.sending;

/** Build state of a contact-activity report as reported by the platform's numeric status. */
public enum ContactActivityStatus {
    PENDING(1),
    COMPLETED(2),
    UNKNOWN(0);

    private final int code;

    ContactActivityStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static ContactActivityStatus fromCode(int code) {
        for (ContactActivityStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
