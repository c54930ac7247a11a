package edu.arizona.cs.sdqc.features;

/**
 * How the values of a feature channel become columns.
 **/
public enum ChannelEncoding {
	/** One column per key: numbers as is, booleans as 1/0, lists by their size */
	NUMERIC,
	/** One indicator column per key=value pair seen while fitting */
	CATEGORICAL,
	/** Tf-idf weights of the terms of a text or token list */
	TEXT
}
