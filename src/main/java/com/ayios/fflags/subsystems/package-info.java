/**
 * Interfaces for implementation of client components, and the types they exchange.
 * <p>
 * Most applications will not need to refer to these types. You will use them if you are connecting
 * the cache to your own backing store, by implementing {@link com.ayios.fflags.subsystems.FlagStore}.
 */
package com.ayios.fflags.subsystems;
