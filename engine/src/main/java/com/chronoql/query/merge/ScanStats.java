/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.chronoql.query.merge;

/**
 * Counters reported by a worker for one partition, summed on the coordinator.
 */
public class ScanStats {
  private long files;
  private long records;
  private long originalSize;
  private long compressedSize;
  private long querierFiles;
  private long querierMemoryCachedFiles;
  private long querierDiskCachedFiles;
  private long idxScanSize;
  private long idxTook;
  private long fileListTook;

  public ScanStats() {
  }

  public ScanStats(final long files, final long records, final long originalSize, final long compressedSize, final long querierFiles,
      final long querierMemoryCachedFiles, final long querierDiskCachedFiles, final long idxScanSize, final long idxTook,
      final long fileListTook) {
    this.files = files;
    this.records = records;
    this.originalSize = originalSize;
    this.compressedSize = compressedSize;
    this.querierFiles = querierFiles;
    this.querierMemoryCachedFiles = querierMemoryCachedFiles;
    this.querierDiskCachedFiles = querierDiskCachedFiles;
    this.idxScanSize = idxScanSize;
    this.idxTook = idxTook;
    this.fileListTook = fileListTook;
  }

  public ScanStats add(final ScanStats other) {
    if (other == null)
      return this;

    files += other.files;
    records += other.records;
    originalSize += other.originalSize;
    compressedSize += other.compressedSize;
    querierFiles += other.querierFiles;
    querierMemoryCachedFiles += other.querierMemoryCachedFiles;
    querierDiskCachedFiles += other.querierDiskCachedFiles;
    idxScanSize += other.idxScanSize;
    idxTook += other.idxTook;
    fileListTook += other.fileListTook;
    return this;
  }

  public long getFiles() {
    return files;
  }

  public long getRecords() {
    return records;
  }

  public long getOriginalSize() {
    return originalSize;
  }

  public long getCompressedSize() {
    return compressedSize;
  }

  public long getQuerierFiles() {
    return querierFiles;
  }

  public long getQuerierMemoryCachedFiles() {
    return querierMemoryCachedFiles;
  }

  public long getQuerierDiskCachedFiles() {
    return querierDiskCachedFiles;
  }

  public long getIdxScanSize() {
    return idxScanSize;
  }

  public long getIdxTook() {
    return idxTook;
  }

  public long getFileListTook() {
    return fileListTook;
  }

  @Override
  public String toString() {
    return "ScanStats{files=" + files + ", records=" + records + ", originalSize=" + originalSize + ", compressedSize=" + compressedSize
        + ", querierFiles=" + querierFiles + ", querierMemoryCachedFiles=" + querierMemoryCachedFiles + ", querierDiskCachedFiles="
        + querierDiskCachedFiles + ", idxScanSize=" + idxScanSize + ", idxTook=" + idxTook + ", fileListTook=" + fileListTook + '}';
  }
}
