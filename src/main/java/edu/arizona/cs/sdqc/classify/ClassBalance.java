package edu.arizona.cs.sdqc.classify;

/**
 * How training instances are weighted by class.
 **/
public enum ClassBalance {
	/** Every instance weighs 1 */
	NONE,
	/** Instances of class c weigh n / (k * n_c), so every class has the same total weight */
	BALANCED
}
