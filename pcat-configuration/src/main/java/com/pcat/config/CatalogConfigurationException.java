package com.pcat.config;

/**
 * Thrown when a required setting is missing or unusable (e.g. no archive location for a populate pass).
 * Fatal to the operation that needed the setting.
 */
public final class CatalogConfigurationException extends RuntimeException {

    private final String setting;

    public CatalogConfigurationException(String setting, String message) {
        super(message);
        this.setting = setting;
    }

    /** Name of the setting that was missing or invalid (e.g. PCAT_PLUGINS_ZIP_PATH); may be null. */
    public String getSetting() {
        return setting;
    }
}
