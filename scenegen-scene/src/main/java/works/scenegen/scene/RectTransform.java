package works.scenegen.scene;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Transform} for nodes laid out in a 2D user-interface space,
 * positioned by anchors within the parent's rectangle.
 */
public final class RectTransform extends Transform {
	private Vector2 anchorMin = Vector2.ZERO;
	private Vector2 anchorMax = Vector2.ONE;
	private Vector2 pivot = Vector2.HALF;
	private Vector2 anchoredPosition = Vector2.ZERO;
	private Vector2 sizeDelta = Vector2.ZERO;

	RectTransform(SceneNode node) {
		super(node);
	}

	public Vector2 anchorMin() {
		return anchorMin;
	}

	public void setAnchorMin(Vector2 anchorMin) {
		this.anchorMin = requireNonNull(anchorMin);
	}

	public Vector2 anchorMax() {
		return anchorMax;
	}

	public void setAnchorMax(Vector2 anchorMax) {
		this.anchorMax = requireNonNull(anchorMax);
	}

	public Vector2 pivot() {
		return pivot;
	}

	public void setPivot(Vector2 pivot) {
		this.pivot = requireNonNull(pivot);
	}

	public Vector2 anchoredPosition() {
		return anchoredPosition;
	}

	public void setAnchoredPosition(Vector2 anchoredPosition) {
		this.anchoredPosition = requireNonNull(anchoredPosition);
	}

	public Vector2 sizeDelta() {
		return sizeDelta;
	}

	public void setSizeDelta(Vector2 sizeDelta) {
		this.sizeDelta = requireNonNull(sizeDelta);
	}
}
