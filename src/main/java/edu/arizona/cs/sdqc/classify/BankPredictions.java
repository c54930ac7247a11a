package edu.arizona.cs.sdqc.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The predictions of the three classifiers for the same ordered messages.
 **/
public final class BankPredictions {

	private final List<String> base;
	private final List<String> deny;
	private final List<String> query;

	public BankPredictions(List<String> base, List<String> deny, List<String> query) {
		if (base.size() != deny.size() || base.size() != query.size()) {
			throw new IllegalArgumentException("Prediction lists differ in length: base=" + base.size() + ", deny="
					+ deny.size() + ", query=" + query.size());
		}
		this.base = Collections.unmodifiableList(new ArrayList<String>(base));
		this.deny = Collections.unmodifiableList(new ArrayList<String>(deny));
		this.query = Collections.unmodifiableList(new ArrayList<String>(query));
	}

	public List<String> getBase() {
		return base;
	}

	public List<String> getDeny() {
		return deny;
	}

	public List<String> getQuery() {
		return query;
	}

	public List<String> get(BankRole role) {
		switch (role) {
		case BASE:
			return base;
		case DENY:
			return deny;
		case QUERY:
			return query;
		default:
			throw new IllegalStateException("Unhandled role " + role);
		}
	}

	public int size() {
		return base.size();
	}
}
