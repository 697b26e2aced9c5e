package com.eyelevel.mediamigrator.dto.run;

/**
 * Result of an operator action on a single archive or media item.
 *
 * @param id    the archive or item id
 * @param phase the phase the unit is in after the action
 */
public record UnitActionResponse(String id, String phase) {
}
