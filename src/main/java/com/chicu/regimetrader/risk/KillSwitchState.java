package com.chicu.regimetrader.risk;

public enum KillSwitchState {
    ARMED,
    TRIPPED
}
