package org.texttechnologylab.nereval.record;

import com.google.common.collect.ImmutableList;

/**
 * Column names of the tab-separated annotation format.
 */
public final class AnnotationColumns {
	public static final String DOCUMENT_ID = "filename";
	public static final String LABEL = "label";
	public static final String START_SPAN = "start_span";
	public static final String END_SPAN = "end_span";
	public static final String ENTITY_TEXT = "text";

	/**
	 * All columns a row has to carry. Additional columns are tolerated.
	 */
	public static final ImmutableList<String> REQUIRED = ImmutableList.of(DOCUMENT_ID, LABEL, START_SPAN, END_SPAN, ENTITY_TEXT);

	private AnnotationColumns() {
	}
}
