/*
 * Copyright 2016-2019 The Hong Kong University of Science and Technology
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
 */

package kinswing.Exceptions;

import java.util.Locale;

public class EmptyKinaseGroupException extends KinSwingException {

    private final String kinaseId;

    public EmptyKinaseGroupException(String kinaseId) {
        super(String.format(Locale.US, "Kinase %s has no usable substrate sequence.", kinaseId));
        this.kinaseId = kinaseId;
    }

    public String getKinaseId() {
        return kinaseId;
    }
}
