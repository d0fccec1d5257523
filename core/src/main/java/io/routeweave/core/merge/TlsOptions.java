package io.routeweave.core.merge;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/** Named TLS option sets published under {@code tls.options}. */
public final class TlsOptions {

    /** Client certificates verified against the CA when presented. */
    public static final String MTLS_VERIFY = "mtls-verify";

    /** TLS 1.2+ with forward-secret AEAD suites only. */
    public static final String TLS_HARDENED = "tls-hardened";

    static final List<String> HARDENED_CIPHER_SUITES = List.of(
            "TLS_ECDHE_ECDSA_WITH_AES_128_GCM_SHA256",
            "TLS_ECDHE_RSA_WITH_AES_128_GCM_SHA256",
            "TLS_ECDHE_ECDSA_WITH_AES_256_GCM_SHA384",
            "TLS_ECDHE_RSA_WITH_AES_256_GCM_SHA384",
            "TLS_ECDHE_ECDSA_WITH_CHACHA20_POLY1305_SHA256",
            "TLS_ECDHE_RSA_WITH_CHACHA20_POLY1305_SHA256");

    static final List<String> HARDENED_CURVES = List.of("X25519", "CurveP384", "CurveP521");

    private TlsOptions() {
        // utility class
    }

    static ObjectNode mtlsVerify(String caCertPath) {
        ObjectNode options = JsonNodeFactory.instance.objectNode();
        ObjectNode clientAuth = options.putObject("clientAuth");
        clientAuth.putArray("caFiles").add(caCertPath);
        clientAuth.put("clientAuthType", "VerifyClientCertIfGiven");
        options.put("minVersion", "VersionTLS12");
        options.put("sniStrict", true);
        return options;
    }

    static ObjectNode hardened() {
        ObjectNode options = JsonNodeFactory.instance.objectNode();
        options.put("minVersion", "VersionTLS12");
        options.put("maxVersion", "VersionTLS13");
        options.put("sniStrict", true);
        ArrayNode suites = options.putArray("cipherSuites");
        HARDENED_CIPHER_SUITES.forEach(suites::add);
        ArrayNode curves = options.putArray("curvePreferences");
        HARDENED_CURVES.forEach(curves::add);
        return options;
    }
}
