package io.routeweave.core.store;

import io.routeweave.core.model.SecuritySettings;

/** Read contract for the global TLS hardening and secure headers settings. */
public interface SecuritySettingsProvider {

    SecuritySettings securitySettings();
}
