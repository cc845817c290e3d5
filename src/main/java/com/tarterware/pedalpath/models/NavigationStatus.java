package com.tarterware.pedalpath.models;

public enum NavigationStatus
{
    IDLE, ACTIVE, PAUSED
}
