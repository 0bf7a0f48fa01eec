package com.syntharb.exception;

import java.util.Map;

public class LegIndexOutOfRangeException extends BaseException {

    public LegIndexOutOfRangeException(String positionId, int legIndex, int legCount) {
        super(
                ErrorCode.LEG_INDEX_OUT_OF_RANGE,
                String.format("Leg index %d out of range for position %s with %d legs", legIndex, positionId, legCount),
                Map.of("positionId", positionId, "legIndex", legIndex, "legCount", legCount));
    }
}
