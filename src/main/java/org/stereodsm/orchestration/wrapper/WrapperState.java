package org.stereodsm.orchestration.wrapper;

public enum WrapperState
{
	UNINITIALIZED,
	ACTIVE,
	CLEANED
}
