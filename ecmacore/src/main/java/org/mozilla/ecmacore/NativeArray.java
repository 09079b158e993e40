/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This class implements the Array native object, an exotic object whose "length" property tracks
 * its array index properties.
 *
 * <p>See ECMA 5 15.4.5.1.
 */
public class NativeArray extends NativeObject {
    private static final long serialVersionUID = 7331366857676127338L;

    private static final String LENGTH = "length";

    public NativeArray(ScriptableObject prototype) {
        super(prototype);
        getPropertyMap()
                .put(LENGTH, new PropertyDescriptor(false, true, false, ScriptRuntime.zeroObj));
    }

    @Override
    public String getClassName() {
        return "Array";
    }

    public long getLength() {
        return ScriptRuntime.toUint32(getPropertyMap().get(LENGTH).getValue());
    }

    @Override
    public boolean defineOwnProperty(Object id, PropertyDescriptor desc, boolean throwOnFailure) {
        Object key = toKey(id);
        if (LENGTH.equals(key)) {
            return defineLength(desc, throwOnFailure);
        }
        long index = ScriptRuntime.indexFromKey(key);
        if (index < 0) {
            return super.defineOwnProperty(key, desc, throwOnFailure);
        }
        PropertyDescriptor lengthDesc = getPropertyMap().get(LENGTH);
        long oldLen = getLength();
        if (index >= oldLen && !lengthDesc.isWritable()) {
            return reject(throwOnFailure, "msg.arraylength.not.writable", key);
        }
        if (!super.defineOwnProperty(key, desc, throwOnFailure)) {
            return false;
        }
        if (index >= oldLen) {
            getPropertyMap().put(LENGTH, lengthDesc.withValue(ScriptRuntime.wrapIndex(index + 1)));
        }
        return true;
    }

    private boolean defineLength(PropertyDescriptor desc, boolean throwOnFailure) {
        if (!desc.hasValue()) {
            return super.defineOwnProperty(LENGTH, desc, throwOnFailure);
        }
        long newLen = ScriptRuntime.toUint32(desc.value);
        if (newLen != ScriptRuntime.toNumber(desc.value)) {
            throw ScriptRuntime.rangeErrorById("msg.arraylength.bad");
        }
        PropertyDescriptor newLenDesc = desc.withValue(ScriptRuntime.wrapIndex(newLen));
        PropertyDescriptor oldLenDesc = getPropertyMap().get(LENGTH);
        long oldLen = getLength();
        if (newLen >= oldLen) {
            return super.defineOwnProperty(LENGTH, newLenDesc, throwOnFailure);
        }
        if (!oldLenDesc.isWritable()) {
            return reject(throwOnFailure, "msg.change.value.with.writable.false", LENGTH);
        }
        // a non-writable length is applied once the elements are gone
        boolean newWritable = !newLenDesc.hasWritable() || newLenDesc.isWritable();
        if (!newWritable) {
            newLenDesc = newLenDesc.withWritable(true);
        }
        if (!super.defineOwnProperty(LENGTH, newLenDesc, throwOnFailure)) {
            return false;
        }
        for (long index : indicesFrom(newLen)) {
            if (!delete(Long.toString(index), false)) {
                PropertyDescriptor blocked =
                        getPropertyMap().get(LENGTH).withValue(ScriptRuntime.wrapIndex(index + 1));
                if (!newWritable) {
                    blocked = blocked.withWritable(false);
                }
                getPropertyMap().put(LENGTH, blocked);
                return reject(
                        throwOnFailure,
                        "msg.arraylength.truncation.blocked",
                        ScriptRuntime.wrapIndex(index));
            }
        }
        if (!newWritable) {
            getPropertyMap().put(LENGTH, getPropertyMap().get(LENGTH).withWritable(false));
        }
        return true;
    }

    /** Own array indices at or above {@code from}, highest first. */
    private List<Long> indicesFrom(long from) {
        List<Long> indices = new ArrayList<>();
        for (Object key : getOwnPropertyKeys()) {
            long index = ScriptRuntime.indexFromKey(key);
            if (index >= from) {
                indices.add(Long.valueOf(index));
            }
        }
        Collections.sort(indices, Collections.reverseOrder());
        return indices;
    }
}
