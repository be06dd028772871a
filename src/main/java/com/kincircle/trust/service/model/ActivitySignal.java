package com.kincircle.trust.service.model;

/** User activity that postpones the idle lock. */
public enum ActivitySignal {
    POINTER,
    KEYBOARD,
    SCROLL,
    TOUCH
}
