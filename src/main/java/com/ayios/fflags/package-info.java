/**
 * The main package for the FFlags client.
 * <p>
 * You will most often use {@link com.ayios.fflags.FFlagsClient} (the client) and
 * {@link com.ayios.fflags.FFlagsConfig} (configuration options for the client).
 * <p>
 * Other commonly used types such as {@link com.ayios.fflags.interfaces.FlagTracker} are in the
 * {@code com.ayios.fflags.interfaces} package.
 */
package com.ayios.fflags;
