package com.logistics.churn.model;

public enum ChangeDirection {
    UP("up"),
    DOWN("down");

    private final String code;

    ChangeDirection(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ChangeDirection fromCode(String code) {
        if (code == null) return null;
        for (ChangeDirection direction : values()) {
            if (direction.code.equals(code)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown change direction: " + code);
    }
}
