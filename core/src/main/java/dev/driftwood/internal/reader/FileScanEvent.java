/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.reader;

import jdk.jfr.Category;
import jdk.jfr.DataAmount;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event emitted when Driftwood scans a data file for new lines.
 * <p>
 * One event is committed per {@code update()} of an indexed file, covering the bytes
 * read from the resume position up to the end of the file.
 * </p>
 */
@Name("dev.driftwood.FileScan")
@Label("File Scan")
@Category({"Driftwood", "I/O"})
@Description("Scan of a delimited text file to index newly appended lines")
public class FileScanEvent extends Event {

    @Label("File Path")
    @Description("Path to the data file being scanned")
    public String path;

    @Label("Start Offset")
    @Description("Byte offset the scan resumed at")
    public long startOffset;

    @Label("Bytes Scanned")
    @DataAmount
    @Description("Number of bytes read from the data file")
    public long bytesScanned;

    @Label("Rows Added")
    @Description("Number of data rows appended to the offset index")
    public long rowsAdded;

    @Label("Header Found")
    @Description("Whether the header line was read during this scan")
    public boolean headerFound;
}
