package com.wardroute.router.dto;

import com.wardroute.router.model.ClusterBounds;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClusterBoundsDto {

    private double minLongitude;
    private double maxLongitude;
    private double minLatitude;
    private double maxLatitude;

    public static ClusterBoundsDto from(ClusterBounds bounds) {
        return new ClusterBoundsDto(bounds.getMinLongitude(), bounds.getMaxLongitude(),
                bounds.getMinLatitude(), bounds.getMaxLatitude());
    }
}
