/**
 * SQLite persistence of BinDiff result files: schema, loader, writer and the
 * {@link de.bsommerfeld.bindiff.db.BinDiffFile} handle combining them.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Diffing engine]            [Viewer / tooling]
 *         │ (producer)                 │ (consumer)
 *         ▼                            ▼
 *   BinDiffFile "rw"             BinDiffFile "ro"
 *         │                            │
 *         ▼                            ▼
 *   ResultFileWriter             ResultFileLoader ──► ResultIndex (immutable)
 *         │                            │
 *         └──────────┬─────────────────┘
 *                    ▼
 *        SqlLoader (sql/*.sql) + schema.sql
 * </pre>
 *
 * <h2>Tables</h2>
 *
 * <pre>
 * file                one row per binary, first = primary, second = secondary
 * metadata            single row: version, description, timestamps, scores
 * functionalgorithm   code → "function: &lt;name&gt;"
 * basicblockalgorithm code → "basicBlock: &lt;name&gt;"
 * function            matched function pairs, UNIQUE(address1, address2)
 * basicblock          matched block pairs, functionid → function.id
 * instruction         matched instruction pairs, basicblockid → basicblock.id
 * </pre>
 *
 * Addresses are unsigned 64-bit values stored in signed INTEGER columns; see
 * {@link de.bsommerfeld.bindiff.core.util.AddressCodec}.
 *
 * <h2>SQL File Inventory</h2>
 * <ul>
 * <li>{@code insert-function-algorithm.sql}, {@code insert-basicblock-algorithm.sql}:
 * lookup rows written at schema installation</li>
 * <li>{@code insert-metadata.sql}, {@code update-metadata-modified.sql},
 * {@code update-metadata-scores.sql}</li>
 * <li>{@code insert-file.sql}, {@code update-file-infos.sql}</li>
 * <li>{@code insert-function.sql}, {@code update-function-basicblocks.sql}</li>
 * <li>{@code insert-basicblock.sql}, {@code insert-instruction.sql}</li>
 * <li>{@code select-last-rowid.sql}: surrogate id of the previous insert</li>
 * <li>{@code select-metadata.sql}, {@code select-files.sql},
 * {@code select-functions.sql}, {@code select-basicblocks.sql},
 * {@code select-instructions.sql}: the loader's full-table scans</li>
 * </ul>
 */
package de.bsommerfeld.bindiff.db;
