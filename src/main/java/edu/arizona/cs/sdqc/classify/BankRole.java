package edu.arizona.cs.sdqc.classify;

import java.util.ArrayList;
import java.util.List;

import edu.arizona.cs.sdqc.model.StanceLabel;

/**
 * The three classifiers of the bank and the labels each of them learns.
 **/
public enum BankRole {

	/** All four stance classes */
	BASE("base", null),
	/** deny against not_deny */
	DENY("deny", StanceLabel.DENY),
	/** query against not_query */
	QUERY("query", StanceLabel.QUERY);

	private final String roleName;
	private final StanceLabel target;

	BankRole(String roleName, StanceLabel target) {
		this.roleName = roleName;
		this.target = target;
	}

	public String roleName() {
		return roleName;
	}

	/*
	 * The one-vs-rest target, null for the base classifier
	 */
	public StanceLabel target() {
		return target;
	}

	public List<String> classNames() {
		return target == null ? StanceLabel.labelNames() : LabelRelabeler.classNames(target);
	}

	/*
	 * The gold stance labels as this classifier sees them
	 */
	public List<String> labelsFor(List<StanceLabel> gold) {
		if (target != null) {
			return LabelRelabeler.relabel(gold, target);
		}
		List<String> names = new ArrayList<String>(gold.size());
		for (StanceLabel label : gold) {
			names.add(label.labelName());
		}
		return names;
	}
}
