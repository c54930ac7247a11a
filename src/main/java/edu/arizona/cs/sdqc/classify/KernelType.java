package edu.arizona.cs.sdqc.classify;

/**
 * Kernel families of the support vector classifiers.
 **/
public enum KernelType {
	LINEAR,
	RBF,
	POLYNOMIAL
}
