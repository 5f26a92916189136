package com.z254.butterfly.prism.api.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Graph edge for rendering. For an undetermined edge {@code from}/{@code to} are in name order.
 */
@Data
@Builder
public class EdgeDto {
    private String from;
    private String to;
    private String direction;
    private boolean directed;
}
