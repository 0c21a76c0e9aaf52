package dev.pekelund.spandana;

import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Anchor for the package structure of the core module. Each direct sub-package
 * ({@code csv}, {@code credentials}, {@code complaints}, {@code ledger},
 * {@code tickets}) is treated as an application module.
 *
 * <p>The applications import the individual module configurations instead of
 * scanning this package.
 */
@SpringBootApplication
public class CoreModulithConfiguration {
}
