/**
 * Vigil source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.vigil.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.vigil.cli.VigilCommand} maps commands to runtime APIs; {@code SupervisorHttpApi} serves them over HTTP.</li>
 *   <li>{@code io.vigil.runtime.VigilRuntime} wires the registry, heartbeat ingest, reaper, emitter and stream fan-out.</li>
 *   <li>{@code io.vigil.storage.InstanceStore} is the authoritative record of instance state transitions.</li>
 * </ul>
 */
package io.vigil;
