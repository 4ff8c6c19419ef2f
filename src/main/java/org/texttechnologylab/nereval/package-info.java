/**
 * org.texttechnologylab.nereval scores named entity recognition predictions against a gold standard, reporting
 * precision, recall and F1 per document and micro-averaged over a whole collection.<br>
 * Spans are matched exactly on document, offset pair and label.
 * <p/>
 * The core lives in {@link org.texttechnologylab.nereval.record} (loading, normalization, deduplication) and
 * {@link org.texttechnologylab.nereval.engine} (counting and metric derivation). {@link
 * org.texttechnologylab.nereval.NerEvaluation} wires both to the TSV reader.
 *
 * @see <a href="https://www.texttechnologylab.org/">Text Technology Lab</a>
 */
package org.texttechnologylab.nereval;
