package com.wardroute.router.exception;

import lombok.Getter;

/**
 * Fatal to the whole optimization run.
 */
@Getter
public class InputException extends RuntimeException {

    public enum Reason {
        EMPTY_DEMAND("No demand points were supplied"),
        NO_ACTIVE_VEHICLES("No active vehicles are available for assignment"),
        DUPLICATE_VEHICLE_ID("Vehicle ids must be unique"),
        DUPLICATE_DEMAND_ID("Demand point ids must be unique");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Reason reason;

    public InputException(Reason reason) {
        super(reason.getDescription());
        this.reason = reason;
    }

    public InputException(Reason reason, String detail) {
        super(reason.getDescription() + ": " + detail);
        this.reason = reason;
    }
}
