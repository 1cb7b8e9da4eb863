/**
 * Runtime orchestration package.
 *
 * <p>{@link io.vigil.runtime.VigilRuntime} owns cross-cutting behavior: settings reload,
 * the background reaper loop, stats, health and the entry points used by the CLI and HTTP API.
 */
package io.vigil.runtime;
