package com.phillippitts.voiceforge.domain;

/** How a conversational turn ended. */
public enum TurnOutcome { COMPLETED, FAILED, CANCELLED }
