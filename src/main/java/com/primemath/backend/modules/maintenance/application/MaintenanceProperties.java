package com.primemath.backend.modules.maintenance.application;

import java.time.Period;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.maintenance")
public class MaintenanceProperties {

    private Period attendanceRetention = Period.ofDays(60);
    private Period workRecordRetention = Period.ofYears(1);
    private boolean promoteOnStartup = true;

    public Period getAttendanceRetention() {
        return attendanceRetention;
    }

    public void setAttendanceRetention(Period attendanceRetention) {
        this.attendanceRetention = attendanceRetention;
    }

    public Period getWorkRecordRetention() {
        return workRecordRetention;
    }

    public void setWorkRecordRetention(Period workRecordRetention) {
        this.workRecordRetention = workRecordRetention;
    }

    public boolean isPromoteOnStartup() {
        return promoteOnStartup;
    }

    public void setPromoteOnStartup(boolean promoteOnStartup) {
        this.promoteOnStartup = promoteOnStartup;
    }
}
