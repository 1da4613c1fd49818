/**
 * This package contains integration tools for connecting the flag client to flag stores, and
 * configuration builders for its components.
 * <p>
 * The stores here are {@link com.ayios.fflags.integrations.TestFlagStore}, for flags supplied from
 * code, and {@link com.ayios.fflags.integrations.FileData}, for flags read from JSON or YAML files.
 */
package com.ayios.fflags.integrations;
