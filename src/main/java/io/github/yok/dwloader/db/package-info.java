/**
 * JDBC and DBUnit connection plumbing for the warehouse database.
 */
package io.github.yok.dwloader.db;
