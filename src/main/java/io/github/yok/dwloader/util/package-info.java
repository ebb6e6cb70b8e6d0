/**
 * Small helpers shared across packages.
 */
package io.github.yok.dwloader.util;
