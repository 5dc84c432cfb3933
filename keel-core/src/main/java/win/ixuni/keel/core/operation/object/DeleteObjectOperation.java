package win.ixuni.keel.core.operation.object;

import lombok.Value;
import win.ixuni.keel.core.operation.Operation;

/**
 * Delete object operation
 * <p>
 * Deleting a key that does not exist succeeds.
 */
@Value
public class DeleteObjectOperation implements Operation<Void> {

    String bucketName;

    String key;
}
