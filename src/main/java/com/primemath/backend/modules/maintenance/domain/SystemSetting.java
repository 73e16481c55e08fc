package com.primemath.backend.modules.maintenance.domain;

import com.primemath.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "system_setting")
public class SystemSetting extends AbstractTimestampedEntity {

    public static final String LAST_GRADE_PROMOTION_YEAR = "last_grade_promotion_year";

    @Id
    @Column(name = "setting_key", nullable = false, updatable = false, length = 100)
    private String key;

    @Column(name = "setting_value", columnDefinition = "text")
    private String value;

    protected SystemSetting() {
    }

    public SystemSetting(String key, String value) {
        this.key = key;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }
}
