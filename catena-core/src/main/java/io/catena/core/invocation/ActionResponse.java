package io.catena.core.invocation;

/// Reply of an external collaborator.
///
/// @param success whether the call succeeded
/// @param output call output, may be null
/// @param error failure description, null on success
public record ActionResponse(boolean success, Object output, String error) {

    public static ActionResponse success(Object output) {
        return new ActionResponse(true, output, null);
    }

    public static ActionResponse failure(String error) {
        return new ActionResponse(false, null, error);
    }
}
