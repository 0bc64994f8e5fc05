package dev.haddaf.sync;

import org.springframework.modulith.Modulithic;

/**
 * Anchor for module verification of the core packages. Each direct sub-package is one module.
 */
@Modulithic(systemName = "haddaf-sync-core")
public final class CoreModulithConfiguration {

    private CoreModulithConfiguration() {
    }
}
