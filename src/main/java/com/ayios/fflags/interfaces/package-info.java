/**
 * Types that are part of the public API of the flag client: the client interface, the flag change
 * and refresh interval notifications, and the query filter hook.
 */
package com.ayios.fflags.interfaces;
