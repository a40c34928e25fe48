package works.scenegen.emit;

/**
 * The settable components of a node's frame.
 */
public enum FrameProperty {
	POSITION,
	ROTATION,
	SCALE,
	ANCHOR_MIN,
	ANCHOR_MAX,
	PIVOT,
	ANCHORED_POSITION,
	SIZE_DELTA,
}
