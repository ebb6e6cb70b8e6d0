/**
 * Configuration classes bound from {@code application.yml}.
 *
 * <p>
 * The classes in this package are read once at process entry. {@link TableSpecResolver} turns them
 * into immutable table definitions; the core never reads Spring state.
 * </p>
 */
package io.github.yok.dwloader.config;
