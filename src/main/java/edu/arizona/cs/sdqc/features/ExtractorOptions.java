package edu.arizona.cs.sdqc.features;

/**
 * Settings handed to a feature extractor. The stance task is task "A" of the
 * rumour evaluation and keeps hashtags and mentions in the text.
 **/
public final class ExtractorOptions {

	public static final String STANCE_TASK = "A";

	private final String task;
	private final boolean stripHashtags;
	private final boolean stripMentions;

	public ExtractorOptions(String task, boolean stripHashtags, boolean stripMentions) {
		this.task = task;
		this.stripHashtags = stripHashtags;
		this.stripMentions = stripMentions;
	}

	public static ExtractorOptions stanceDefaults() {
		return new ExtractorOptions(STANCE_TASK, false, false);
	}

	public String getTask() {
		return task;
	}

	public boolean isStripHashtags() {
		return stripHashtags;
	}

	public boolean isStripMentions() {
		return stripMentions;
	}

	@Override
	public String toString() {
		return "task=" + task + ", stripHashtags=" + stripHashtags + ", stripMentions=" + stripMentions;
	}
}
