package edu.arizona.cs.sdqc.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import edu.arizona.cs.sdqc.model.Annotations;
import edu.arizona.cs.sdqc.model.StanceLabel;

/**
 * Turns four-class stance annotations into the two-class labels of a
 * one-vs-rest classifier: the target label, or "not_" followed by it.
 **/
public final class LabelRelabeler {

	private LabelRelabeler() {
	}

	public static Map<String, String> relabel(Annotations annotations, StanceLabel target) {
		Map<String, String> oneVsRest = new LinkedHashMap<String, String>();
		for (Map.Entry<String, StanceLabel> entry : annotations.asMap().entrySet()) {
			oneVsRest.put(entry.getKey(), relabel(entry.getValue(), target));
		}
		return oneVsRest;
	}

	public static String relabel(StanceLabel label, StanceLabel target) {
		return label == target ? target.labelName() : target.notLabelName();
	}

	public static List<String> relabel(List<StanceLabel> labels, StanceLabel target) {
		List<String> oneVsRest = new ArrayList<String>(labels.size());
		for (StanceLabel label : labels) {
			oneVsRest.add(relabel(label, target));
		}
		return oneVsRest;
	}

	/*
	 * The class names of the one-vs-rest problem, sorted by name
	 */
	public static List<String> classNames(StanceLabel target) {
		List<String> names = new ArrayList<String>();
		names.add(target.labelName());
		names.add(target.notLabelName());
		Collections.sort(names);
		return names;
	}
}
