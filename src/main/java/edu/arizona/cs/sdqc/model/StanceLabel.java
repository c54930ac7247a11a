package edu.arizona.cs.sdqc.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The four stance classes a reply can take towards the claim of its thread.
 * Declared in the alphabetical order of their names, which is also the order
 * of the class values handed to Weka.
 **/
public enum StanceLabel {

	COMMENT("comment"),
	DENY("deny"),
	QUERY("query"),
	SUPPORT("support");

	private final String labelName;

	StanceLabel(String labelName) {
		this.labelName = labelName;
	}

	/*
	 * The lower case name used in annotation files and classifier outputs
	 */
	public String labelName() {
		return labelName;
	}

	/*
	 * The name of the opposite class when this label is the target of a
	 * one-vs-rest classifier, e.g. "not_deny"
	 */
	public String notLabelName() {
		return "not_" + labelName;
	}

	/**
	 * Parses a label as it appears in annotations or predictions. Anything that
	 * is not one of the four stance names is rejected.
	 **/
	public static StanceLabel fromName(String name) {
		if (name != null) {
			String trimmed = name.trim();
			for (StanceLabel label : values()) {
				if (label.labelName.equalsIgnoreCase(trimmed)) {
					return label;
				}
			}
		}
		throw new IllegalArgumentException("Unknown stance label: " + name);
	}

	/*
	 * All four label names, in class value order
	 */
	public static List<String> labelNames() {
		List<String> names = new ArrayList<String>();
		for (StanceLabel label : values()) {
			names.add(label.labelName);
		}
		return names;
	}

	@Override
	public String toString() {
		return labelName;
	}
}
