package edu.arizona.cs.sdqc.ensemble;

import edu.arizona.cs.sdqc.model.StanceLabel;

/**
 * Rules merging the outputs of the base, deny and query classifiers for one
 * message.
 **/
public enum CombinationStrategy {

	/**
	 * A base comment stays a comment; otherwise a query detection wins;
	 * otherwise the base label.
	 **/
	WITHOUT_DENY("combined w/o deny") {
		@Override
		public StanceLabel combine(String base, String deny, String query) {
			if (StanceLabel.COMMENT.labelName().equals(base)) {
				return StanceLabel.COMMENT;
			}
			if (StanceLabel.QUERY.labelName().equals(query)) {
				return StanceLabel.QUERY;
			}
			return StanceLabel.fromName(base);
		}
	},

	/**
	 * A query detection wins, then a deny detection, then the base label.
	 **/
	WITH_DENY("combined w/ deny") {
		@Override
		public StanceLabel combine(String base, String deny, String query) {
			if (StanceLabel.QUERY.labelName().equals(query)) {
				return StanceLabel.QUERY;
			}
			if (StanceLabel.DENY.labelName().equals(deny)) {
				return StanceLabel.DENY;
			}
			return StanceLabel.fromName(base);
		}
	};

	private final String description;

	CombinationStrategy(String description) {
		this.description = description;
	}

	public String description() {
		return description;
	}

	/**
	 * @param base  the four-class prediction
	 * @param deny  deny or not_deny
	 * @param query query or not_query
	 **/
	public abstract StanceLabel combine(String base, String deny, String query);
}
