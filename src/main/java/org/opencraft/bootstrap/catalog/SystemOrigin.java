package org.opencraft.bootstrap.catalog;

/**
 * Where a system was registered from. Deployment worlds only use engine and package systems.
 */
public enum SystemOrigin {
    ENGINE,
    PACKAGE,
    APPLICATION
}
