package com.example.roster.common;

import com.example.roster.engine.ShiftType;
import com.example.roster.exception.BusinessException;

public final class ShiftKeys {

    public static final String INVALID_SHIFT_TYPE = "INVALID_SHIFT_TYPE";

    private ShiftKeys() {
    }

    /**
     * APIで受け取ったシフト名（別名を含む）をシフト種別に変換する。
     */
    public static ShiftType parse(String key) {
        return ShiftType.fromKey(key)
                .orElseThrow(() -> new BusinessException(INVALID_SHIFT_TYPE, "不明なシフト種別です: " + key, key));
    }

    public static ShiftType parseOptional(String key) {
        return key == null || key.isBlank() ? null : parse(key);
    }
}
