package com.factory.stockkeeper.service;

import com.factory.stockkeeper.model.AppSetting;
import com.factory.stockkeeper.repository.AppSettingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Tunables for allocation, expiry classification and stock alerts. A row in
 * {@code app_settings} overrides the value from {@code application.properties}.
 */
@Service
@Slf4j
public class SettingsService {

    private final AppSettingRepository appSettingRepository;
    private final Environment environment;

    public static final String KEY_MAX_RETRIES = "manufacturing.allocation.max-retries";
    public static final String KEY_RETRY_BACKOFF_MS = "manufacturing.allocation.retry-backoff-ms";
    public static final String KEY_ALLOW_EXPIRED = "manufacturing.allocation.allow-expired";
    public static final String KEY_CRITICAL_DAYS = "manufacturing.expiry.critical-days";
    public static final String KEY_WARNING_DAYS = "manufacturing.expiry.warning-days";
    public static final String KEY_LOW_STOCK_THRESHOLD = "manufacturing.stock.low-threshold";

    public SettingsService(AppSettingRepository appSettingRepository, Environment environment) {
        this.appSettingRepository = appSettingRepository;
        this.environment = environment;
    }

    public int getMaxRetries() {
        return getInt(KEY_MAX_RETRIES, 3);
    }

    public long getRetryBackoffMs() {
        return getInt(KEY_RETRY_BACKOFF_MS, 50);
    }

    public boolean isAllowExpired() {
        return Boolean.parseBoolean(getValue(KEY_ALLOW_EXPIRED).orElse("true"));
    }

    public int getCriticalDays() {
        return getInt(KEY_CRITICAL_DAYS, 7);
    }

    public int getWarningDays() {
        return getInt(KEY_WARNING_DAYS, 30);
    }

    public int getLowStockThreshold() {
        return getInt(KEY_LOW_STOCK_THRESHOLD, 50);
    }

    @Transactional
    public void updateSetting(String key, String value, String actor) {
        Optional<AppSetting> existing = appSettingRepository.findBySettingKey(key);
        if (existing.isPresent()) {
            AppSetting setting = existing.get();
            setting.setSettingValue(value != null ? value : "");
            setting.setUpdatedBy(actor);
            appSettingRepository.save(setting);
        } else {
            appSettingRepository.save(new AppSetting(key, value != null ? value : "", actor));
        }
    }

    private Optional<String> getValue(String key) {
        Optional<String> stored = appSettingRepository.findBySettingKey(key)
                .map(AppSetting::getSettingValue)
                .filter(val -> !val.isBlank());
        if (stored.isPresent()) {
            return stored;
        }
        return Optional.ofNullable(environment.getProperty(key));
    }

    private int getInt(String key, int defaultValue) {
        return getValue(key)
                .map(val -> {
                    try {
                        return Integer.parseInt(val.trim());
                    } catch (NumberFormatException e) {
                        log.warn("Ignoring non-numeric value '{}' for {}", val, key);
                        return defaultValue;
                    }
                })
                .orElse(defaultValue);
    }
}
