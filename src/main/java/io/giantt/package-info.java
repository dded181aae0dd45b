/**
 * Giantt source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.giantt.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.giantt.cli.GianttCommand} maps commands to core calls.</li>
 *   <li>{@code io.giantt.notation.ItemNotation} reads and writes the one-line item format.</li>
 *   <li>{@code io.giantt.graph.ItemGraph} owns relation mirroring, cycle rejection and ordering.</li>
 *   <li>{@code io.giantt.storage.FileRepository} loads and saves item files with include resolution.</li>
 * </ul>
 */
package io.giantt;
