package org.sheetrenamer.view;

import org.eclipse.swt.SWT;

enum SWTMessageBoxType {
    DLG_OK(SWT.ICON_INFORMATION),
    DLG_WARN(SWT.ICON_WARNING),
    DLG_ERR(SWT.ICON_ERROR);

    final int swtIconValue;

    SWTMessageBoxType(int swtIconValue) {
        this.swtIconValue = swtIconValue;
    }
}
