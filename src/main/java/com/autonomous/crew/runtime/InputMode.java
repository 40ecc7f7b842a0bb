package com.autonomous.crew.runtime;

public enum InputMode {
    /** prompt is written to the child's stdin, which is then closed */
    STDIN,
    /** prompt is already part of the argument vector */
    ARGUMENT
}
