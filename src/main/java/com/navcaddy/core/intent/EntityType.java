package com.navcaddy.core.intent;

public enum EntityType {
    CLUB,
    YARDAGE,
    LIE,
    WIND,
    FATIGUE,
    PAIN,
    SCORE_CONTEXT,
    HOLE_NUMBER,
    COURSE_NAME,
    DRILL_TYPE,
    STAT_TYPE,
    EQUIPMENT_TYPE,
    SETTING_KEY,
    FEEDBACK_TEXT
}
