package com.di.statsrollup.rollup;

import com.di.statsrollup.exception.MalformedRecordException;
import com.di.statsrollup.exception.MissingCategoryException;
import com.di.statsrollup.model.DiskIoStats;
import com.di.statsrollup.model.DiskIoStats.PerDiskStats;
import org.springframework.stereotype.Component;

/**
 * Sums one {@link DiskIoCategory} across every device entry of a sample's {@code io_service_bytes}.
 * Values are aggregated across all volumes; per-device figures are not reported.
 */
@Component
public class DiskIoReducer {

    /**
     * @return total bytes for {@code category}; 0 when the device list is empty
     * @throws MalformedRecordException  if the record or its device list is absent
     * @throws MissingCategoryException  if a device entry has no count for {@code category}
     */
    public long sumCategory(DiskIoStats diskio, DiskIoCategory category) {
        if (diskio == null || diskio.ioServiceBytes() == null) {
            throw new MalformedRecordException("Disk I/O record has no io_service_bytes list");
        }
        long total = 0L;
        for (PerDiskStats entry : diskio.ioServiceBytes()) {
            if (entry == null) {
                throw new MalformedRecordException("Disk I/O record contains a null device entry");
            }
            Long bytes = entry.stats() != null ? entry.stats().get(category.getKey()) : null;
            if (bytes == null) {
                throw new MissingCategoryException(category, entry.major(), entry.minor());
            }
            total += bytes;
        }
        return total;
    }
}
