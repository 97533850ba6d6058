package org.mark.capability;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 	可以手动拨动的时钟。
 */
public class MutableClock extends Clock {
	
	private volatile Instant now;
	
	
	public MutableClock(Instant start) {
		this.now = start;
	}
	
	
	public void advance(Duration duration) {
		this.now = this.now.plus(duration);
	}
	
	
	@Override
	public ZoneId getZone() {
		return ZoneOffset.UTC;
	}
	
	
	@Override
	public Clock withZone(ZoneId zone) {
		return this;
	}
	
	
	@Override
	public Instant instant() {
		return this.now;
	}
}
