package works.mongobridge;

/**
 * Where the {@link Outcome} of a dispatched operation goes.
 */
public interface Delivery<T> {
	/**
	 * @return false if nobody will look at a {@link Outcome.Success} or {@link Outcome.Failure},
	 * in which case the operation may skip any work needed only to determine its status.
	 */
	boolean requiresStatus();

	void deliver(Outcome<T> outcome);

	/**
	 * @return a delivery that ignores every outcome.
	 */
	@SuppressWarnings("unchecked")
	static <T> Delivery<T> discard() {
		return (Delivery<T>) DISCARD;
	}

	/**
	 * @return a delivery that reports every outcome to <code>callback</code>.
	 * Since a callback always wants to know, {@link #requiresStatus()} is true.
	 */
	static <T> Delivery<T> toCallback(Callback<T> callback) {
		return new Delivery<>() {
			@Override
			public boolean requiresStatus() {
				return true;
			}

			@Override
			public void deliver(Outcome<T> outcome) {
				if (outcome instanceof Outcome.Success<T> s) {
					callback.onResult(s.value(), null);
				} else if (outcome instanceof Outcome.Failure<T> f) {
					callback.onResult(null, f.message());
				}
			}
		};
	}

	Delivery<?> DISCARD = new Delivery<Object>() {
		@Override
		public boolean requiresStatus() {
			return false;
		}

		@Override
		public void deliver(Outcome<Object> outcome) { }

		@Override
		public String toString() {
			return "Delivery.DISCARD";
		}
	};
}
