package app.scapin.memory.worker;

public enum WorkerState {
    IDLE, RUNNING, PAUSED, STOPPED
}
