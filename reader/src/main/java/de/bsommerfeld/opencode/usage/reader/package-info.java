/**
 * Read path over OpenCode's on-disk part storage: {@link
 * de.bsommerfeld.opencode.usage.reader.StorageScanner} finds part files,
 * {@link de.bsommerfeld.opencode.usage.reader.UsageParser} decodes them and
 * {@link de.bsommerfeld.opencode.usage.reader.UsageAggregator} sums the
 * relevant ones. {@link de.bsommerfeld.opencode.usage.reader.UsageReader}
 * ties the three together behind a time-boxed cache.
 */
package de.bsommerfeld.opencode.usage.reader;
