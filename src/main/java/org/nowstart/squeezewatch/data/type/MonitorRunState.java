package org.nowstart.squeezewatch.data.type;

public enum MonitorRunState {
    STOPPED,
    RUNNING
}
