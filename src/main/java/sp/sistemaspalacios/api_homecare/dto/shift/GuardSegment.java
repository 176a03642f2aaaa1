package sp.sistemaspalacios.api_homecare.dto.shift;

import sp.sistemaspalacios.api_homecare.entity.shift.GuardSegmentType;

public record GuardSegment(String startTime, GuardSegmentType type, int breakMinutes) {
}
