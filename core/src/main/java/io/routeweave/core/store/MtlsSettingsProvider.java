package io.routeweave.core.store;

import io.routeweave.core.model.MtlsSettings;
import io.routeweave.core.model.MtlsStatus;

/** Read contract of the certificate authority collaborator. */
public interface MtlsSettingsProvider {

    MtlsSettings mtlsSettings();

    /** Narrow view: enabled flag, CA presence and CA path. */
    default MtlsStatus getConfig() {
        return mtlsSettings().status();
    }
}
