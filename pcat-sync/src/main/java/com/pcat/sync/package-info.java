/**
 * Plugin catalog synchronization: archive resolution ({@code archive}), manifest extraction ({@code extract}),
 * descriptor mapping and reconciliation ({@code reconcile}), plus the {@link com.pcat.sync.PluginCatalogManager}
 * entry point for populate and lookup.
 */
package com.pcat.sync;
