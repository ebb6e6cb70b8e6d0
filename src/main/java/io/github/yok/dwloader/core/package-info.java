/**
 * Core of the loader: bulk loading, merging, the load units of each layer, and the orchestrator
 * that runs them with per-unit transactions and run ledger records.
 */
package io.github.yok.dwloader.core;
